package net.kairos.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드에 묶인 트랜잭션 커넥션 */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** repository 진입점에서 사용. 트랜잭션 밖이면 실패 */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner or SpringTxRunner)");
        return c;
    }
}
