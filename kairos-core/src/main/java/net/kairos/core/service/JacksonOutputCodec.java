package net.kairos.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.kairos.core.spi.OutputCodec;

/** 핸들러 결과를 JSON으로. 읽을 때는 Map/List/스칼라로 복원 */
public final class JacksonOutputCodec implements OutputCodec {
    private final ObjectMapper mapper;

    public JacksonOutputCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public JacksonOutputCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public String encode(Object output) throws Exception {
        return output == null ? null : mapper.writeValueAsString(output);
    }

    @Override
    public Object decode(String encoded) throws Exception {
        return encoded == null ? null : mapper.readValue(encoded, Object.class);
    }
}
