package net.kairos.core.spi;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/** 핸들러에 노출되는 저장소 접근 (query / update / transaction) */
public interface SqlOperations {
    List<Map<String, Object>> query(String sql, Object... params) throws Exception;

    int update(String sql, Object... params) throws Exception;

    <T> T transaction(Callable<T> body) throws Exception;
}
