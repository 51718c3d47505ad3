package net.kairos.adapter.jdbc;

import net.kairos.core.spi.SqlOperations;
import net.kairos.core.spi.TxRunner;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 핸들러에 넘기는 저장소 접근. 각 호출은 TxRunner.required 로 감싸므로
 * transaction() 안에서는 같은 커넥션을 공유한다.
 * 결과 행의 키는 소문자 컬럼 라벨.
 */
public final class JdbcSqlOperations implements SqlOperations {
    private final TxRunner tx;

    public JdbcSqlOperations(TxRunner tx) {
        this.tx = tx;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... params) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
                JdbcUtil.bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    ResultSetMetaData md = rs.getMetaData();
                    List<Map<String, Object>> rows = new ArrayList<>();
                    while (rs.next()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        for (int i = 1; i <= md.getColumnCount(); i++) {
                            row.put(md.getColumnLabel(i).toLowerCase(), rs.getObject(i));
                        }
                        rows.add(row);
                    }
                    return rows;
                }
            }
        });
    }

    @Override
    public int update(String sql, Object... params) throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.require().prepareStatement(sql)) {
                JdbcUtil.bind(ps, params);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public <T> T transaction(Callable<T> body) throws Exception {
        return tx.required(body);
    }
}
