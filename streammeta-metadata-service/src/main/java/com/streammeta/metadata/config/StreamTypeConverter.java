package com.streammeta.metadata.config;

import com.streammeta.common.model.StreamType;
import org.springframework.core.convert.converter.Converter;

/**
 * Binds {@code ?type=logs} style request parameters
 */
public class StreamTypeConverter implements Converter<String, StreamType> {

    @Override
    public StreamType convert(String source) {
        return StreamType.fromString(source);
    }
}
