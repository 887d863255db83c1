package com.pairarb.oms;

import com.pairarb.domain.enums.SpreadDirection;
import com.pairarb.domain.model.Instrument;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;

/**
 * Input for creating an execution target.
 *
 * @param opportunityKey    stable identity of the opportunity, e.g. "AAPLX/AAPL#L2"; at most one active target per key
 * @param targetQuantity1   signed quantity of instrument 1; positive when the direction buys it
 * @param targetQuantity2   signed quantity of instrument 2; opposite sign of {@code targetQuantity1}
 * @param expectedSpreadPct spread the opportunity was detected at; also the minimum each slice must meet
 * @param timeout           null uses the configured default
 */
@Builder
public record ExecutionTargetRequest(
        String opportunityKey,
        Instrument instrument1,
        Instrument instrument2,
        BigDecimal targetQuantity1,
        BigDecimal targetQuantity2,
        SpreadDirection direction,
        BigDecimal expectedSpreadPct,
        Duration timeout) {}
