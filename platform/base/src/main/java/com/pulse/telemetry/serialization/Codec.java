package com.pulse.telemetry.serialization;

import com.pulse.telemetry.base.Result;

/**
 * Conversion of a value to its wire bytes. Never throws; an unencodable value
 * comes back as a failed {@link Result}.
 *
 * @param <A> the type carried
 */
public interface Codec<A> {

    Result<byte[]> encode(A value);
}
