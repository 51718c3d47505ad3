package net.kairos.integration.spring.tx;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** Spring 트랜잭션 위에서 TxContext 를 채워 JDBC repository 를 재사용 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        try {
            return inTemplate(propagation, body);
        } catch (TxBodyException e) {
            // 롤백은 끝났으니 원래 예외로 복원
            throw (Exception) e.getCause();
        }
    }

    private <T> T inTemplate(int propagation, Callable<T> body) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        return tpl.execute(status -> {
            // 현재 스프링 트랜잭션에 묶인 커넥션 (REQUIRES_NEW 면 새 커넥션)
            Connection con = DataSourceUtils.getConnection(ds);
            Connection outer = TxContext.get();
            try {
                TxContext.set(con);
                return body.call();
            } catch (RuntimeException re) {
                throw re;
            } catch (Exception e) {
                throw new TxBodyException(e);
            } finally {
                if (outer != null) TxContext.set(outer); else TxContext.clear();
                DataSourceUtils.releaseConnection(con, ds);
            }
        });
    }

    /** 검사 예외를 트랜잭션 템플릿 밖으로 운반 (롤백 유발) */
    private static final class TxBodyException extends RuntimeException {
        TxBodyException(Exception cause) {
            super(cause.getMessage(), cause);
        }
    }
}
