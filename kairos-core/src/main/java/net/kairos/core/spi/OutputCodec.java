package net.kairos.core.spi;

/** 핸들러 결과 직렬화 (OUTPUT 컬럼) */
public interface OutputCodec {
    String encode(Object output) throws Exception;

    Object decode(String encoded) throws Exception;
}
