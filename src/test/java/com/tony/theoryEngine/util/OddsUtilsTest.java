package com.tony.theoryEngine.util;

import com.tony.theoryEngine.model.engine.BetOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OddsUtilsTest {

    @Test
    @DisplayName("Probabilité implicite : favori, outsider et prix absent")
    void impliedProbability() {
        assertThat(OddsUtils.impliedProbability(-110.0)).isCloseTo(110.0 / 210.0, within(1e-12));
        assertThat(OddsUtils.impliedProbability(150.0)).isCloseTo(0.4, within(1e-12));
        assertThat(OddsUtils.impliedProbability(null)).isNull();
        assertThat(OddsUtils.impliedProbability(0.0)).isNull();
    }

    @Test
    @DisplayName("PnL unitaire selon l'issue")
    void unitPnl() {
        assertThat(OddsUtils.unitPnl(BetOutcome.WIN, -110)).isCloseTo(100.0 / 110.0, within(1e-12));
        assertThat(OddsUtils.unitPnl(BetOutcome.WIN, 150)).isCloseTo(1.5, within(1e-12));
        assertThat(OddsUtils.unitPnl(BetOutcome.LOSS, 150)).isEqualTo(-1.0);
        assertThat(OddsUtils.unitPnl(BetOutcome.PUSH, -110)).isZero();
        assertThat(OddsUtils.unitPnl(null, -110)).isZero();
    }
}
