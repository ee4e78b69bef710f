package io.surfworks.flowgrinder.core.attr;

import java.util.Objects;

/**
 * Attribute value as the exporter tagged it, e.g. {@code at_list_int32 -> [3, 3]}.
 *
 * <p>The payload is a {@link Boolean}, a {@link Number}, a {@link String} or a
 * {@link java.util.List} of numbers. The tag is kept verbatim; deciding
 * whether it is known is the {@link AttributeParser}'s job.
 */
public record RawAttribute(String tag, Object payload) {

    public RawAttribute {
        Objects.requireNonNull(tag, "tag");
    }
}
