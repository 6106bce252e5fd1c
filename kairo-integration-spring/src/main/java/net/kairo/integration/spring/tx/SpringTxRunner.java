package net.kairo.integration.spring.tx;

import net.kairo.adapter.jdbc.TxContext;
import net.kairo.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * {@link TxRunner} on top of a {@link PlatformTransactionManager}. The Spring-bound connection
 * is exposed through {@link TxContext} so the JDBC store can run unchanged.
 * Checked exceptions from the body roll back and are rethrown as-is.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> bind(body));
        } catch (CheckedBodyException e) {
            throw e.getCause();
        }
    }

    private <T> T bind(Callable<T> body) {
        Connection outer = TxContext.get();
        Connection con = DataSourceUtils.getConnection(ds);
        try {
            TxContext.set(con);
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        } finally {
            if (outer != null) TxContext.set(outer);
            else TxContext.clear();
            DataSourceUtils.releaseConnection(con, ds);
        }
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    // carries a checked exception through TransactionTemplate, which only rolls back on unchecked ones
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) {
            super(cause);
        }

        @Override
        public synchronized Exception getCause() {
            return (Exception) super.getCause();
        }
    }
}
