package com.pairarb.exception;

import java.util.Map;

public class InvalidOrderTagException extends BaseException {

    public InvalidOrderTagException(String tag) {
        super(ErrorCode.INVALID_ORDER_TAG, "Unrecognized order tag: " + tag, Map.of("tag", String.valueOf(tag)));
    }
}
