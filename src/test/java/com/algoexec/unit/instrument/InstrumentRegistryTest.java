package com.algoexec.unit.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.algoexec.config.EngineProperties;
import com.algoexec.domain.enums.SecurityType;
import com.algoexec.exception.ConfigurationException;
import com.algoexec.exception.InstrumentNotFoundException;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.unit.TestInstruments;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class InstrumentRegistryTest {

    @Test
    void lookupsByTickerAndDataTicker() {
        InstrumentRegistry registry =
                new InstrumentRegistry(List.of(TestInstruments.aapl(), TestInstruments.leanHogs()));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.getTickers()).containsExactly("AAPL", "HE");
        assertThat(registry.get("HE").isFuture()).isTrue();
        assertThat(registry.findByDataTicker("HE.c.0")).hasValueSatisfying(i -> assertThat(i.getTicker())
                .isEqualTo("HE"));
        assertThat(registry.find("MSFT")).isEmpty();
        assertThatThrownBy(() -> registry.get("MSFT")).isInstanceOf(InstrumentNotFoundException.class);
    }

    @Test
    void duplicateTicker_isConfigurationError() {
        assertThatThrownBy(() -> new InstrumentRegistry(List.of(TestInstruments.aapl(), TestInstruments.aapl())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("AAPL");
    }

    @Test
    void fromProperties_buildsInstruments() {
        EngineProperties properties = new EngineProperties();
        EngineProperties.InstrumentProperties he = new EngineProperties.InstrumentProperties();
        he.setTicker("HE");
        he.setSecurityType(SecurityType.FUTURE);
        he.setInitialMargin(new BigDecimal("1500"));
        he.setQuantityMultiplier(new BigDecimal("40000"));
        he.setPriceMultiplier(new BigDecimal("0.01"));
        he.setTickSize(new BigDecimal("0.025"));
        he.setDataTicker("HE.c.0");
        properties.getInstruments().add(he);

        InstrumentRegistry registry = InstrumentRegistry.fromProperties(properties);

        assertThat(registry.get("HE").contractMultiplier()).isEqualByComparingTo("400");
        assertThat(registry.get("HE").getDataTicker()).isEqualTo("HE.c.0");
    }

    @Test
    void fromProperties_wrapsInvalidInstrument() {
        EngineProperties properties = new EngineProperties();
        EngineProperties.InstrumentProperties es = new EngineProperties.InstrumentProperties();
        es.setTicker("ES");
        es.setSecurityType(SecurityType.FUTURE);
        properties.getInstruments().add(es);

        assertThatThrownBy(() -> InstrumentRegistry.fromProperties(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("ES");
    }
}
