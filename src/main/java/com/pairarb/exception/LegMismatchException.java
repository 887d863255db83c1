package com.pairarb.exception;

import com.pairarb.domain.model.Instrument;
import java.util.Map;

/** An order event resolved to a target whose legs do not include the event's instrument. */
public class LegMismatchException extends BaseException {

    public LegMismatchException(String orderId, Instrument instrument, Instrument leg1, Instrument leg2) {
        super(
                ErrorCode.LEG_MISMATCH,
                "Order " + orderId + " on " + instrument + " does not belong to pair " + leg1 + "/" + leg2,
                Map.of(
                        "orderId", String.valueOf(orderId),
                        "instrument", String.valueOf(instrument),
                        "leg1", String.valueOf(leg1),
                        "leg2", String.valueOf(leg2)));
    }
}
