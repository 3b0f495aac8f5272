package com.sermonarchive.collector.source;

import com.sermonarchive.collector.domain.enums.SourceType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SermonSourceRegistry {

    private final Map<SourceType, SermonSource> byType = new EnumMap<>(SourceType.class);

    public SermonSourceRegistry(List<SermonSource> sources) {
        for (SermonSource source : sources) {
            SermonSource previous = byType.put(source.type(), source);
            if (previous != null) {
                throw new IllegalStateException("Two sources registered for type " + source.type()
                        + ": " + previous.getClass().getSimpleName() + ", " + source.getClass().getSimpleName());
            }
        }
    }

    public SermonSource forType(SourceType type) {
        SermonSource source = byType.get(type);
        if (source == null) {
            throw new IllegalArgumentException("No sermon source for type " + type);
        }
        return source;
    }
}
