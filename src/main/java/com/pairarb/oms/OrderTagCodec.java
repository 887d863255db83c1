package com.pairarb.oms;

import com.pairarb.domain.model.ExecutionTargetId;
import com.pairarb.exception.InvalidOrderTagException;
import org.springframework.stereotype.Component;

/**
 * Encodes an execution target's ID into the tag carried by every order sent for it, and
 * back. Tag format: {@code PX-<id>}, e.g. "PX-42".
 *
 * <p>The ID is minted once by {@link ExecutionTargetRegistry} and is carried verbatim, so
 * the mapping does not depend on object identity or on anything derived from the
 * target's contents.
 */
@Component
public class OrderTagCodec {

    static final String PREFIX = "PX-";

    public String encode(ExecutionTargetId id) {
        return PREFIX + id.value();
    }

    /**
     * @throws InvalidOrderTagException if the tag is missing, lacks the prefix, or does not end in a number
     */
    public ExecutionTargetId decode(String tag) {
        if (tag == null || !tag.startsWith(PREFIX) || tag.length() == PREFIX.length()) {
            throw new InvalidOrderTagException(tag);
        }
        try {
            return new ExecutionTargetId(Long.parseLong(tag.substring(PREFIX.length())));
        } catch (NumberFormatException e) {
            throw new InvalidOrderTagException(tag);
        }
    }
}
