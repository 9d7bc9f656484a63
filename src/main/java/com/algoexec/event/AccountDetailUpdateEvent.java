package com.algoexec.event;

import com.algoexec.domain.model.AccountSnapshot;

public class AccountDetailUpdateEvent extends PortfolioEvent {

    private final AccountSnapshot account;

    public AccountDetailUpdateEvent(Object source, AccountSnapshot account) {
        super(source, PortfolioEventType.ACCOUNT_DETAIL_UPDATE);
        this.account = account;
    }

    public AccountSnapshot getAccount() {
        return account;
    }
}
