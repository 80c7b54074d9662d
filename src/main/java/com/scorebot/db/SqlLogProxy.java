package com.scorebot.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * Wraps a JDBC connection so that statement executions, commits, rollbacks and savepoint
 * releases are logged with their elapsed time.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch"
    );
    private static final Set<String> TX_METHODS = Set.of("commit", "rollback", "releaseSavepoint");
    private static final int MAX_SQL_CHARS = 600;

    private SqlLogProxy() {
    }

    static Connection wrap(Connection delegate, Logger logger) {
        return proxy(Connection.class, new ConnectionHandler(delegate, logger));
    }

    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    private static Object invokeRaw(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    static String oneLine(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= MAX_SQL_CHARS ? normalized : normalized.substring(0, MAX_SQL_CHARS) + "...";
    }

    private static Object timed(Logger logger, String op, String sql, Object target, Method method, Object[] args)
            throws Throwable {
        long started = System.nanoTime();
        try {
            Object out = invokeRaw(target, method, args);
            if (logger.isDebugEnabled()) {
                logger.debug("SQL ok op={} ms={}{} sql={}", op, millis(started), rows(out), oneLine(sql));
            }
            return out;
        } catch (Throwable error) {
            logger.warn("SQL fail op={} ms={} err={} sql={}", op, millis(started), error.getMessage(), oneLine(sql));
            throw error;
        }
    }

    private static String millis(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String rows(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[] counts) {
            return " batch=" + counts.length;
        }
        return "";
    }

    private static final class ConnectionHandler implements InvocationHandler {
        private final Connection delegate;
        private final Logger logger;

        private ConnectionHandler(Connection delegate, Logger logger) {
            this.delegate = delegate;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (TX_METHODS.contains(name)) {
                String detail = args != null && args.length > 0 && args[0] instanceof Savepoint ? "savepoint" : "";
                return timed(logger, name, detail, delegate, method, args);
            }
            Object out = invokeRaw(delegate, method, args);
            if ("prepareStatement".equals(name) && out instanceof PreparedStatement ps && args[0] instanceof String sql) {
                return proxy(PreparedStatement.class, new StatementHandler(ps, sql, logger));
            }
            if ("createStatement".equals(name) && out instanceof Statement st) {
                return proxy(Statement.class, new StatementHandler(st, null, logger));
            }
            return out;
        }
    }

    private static final class StatementHandler implements InvocationHandler {
        private final Statement delegate;
        private final String preparedSql;
        private final Logger logger;

        private StatementHandler(Statement delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (!EXECUTE_METHODS.contains(name)) {
                return invokeRaw(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null && args != null && args.length > 0 && args[0] instanceof String text) {
                sql = text;
            }
            return timed(logger, name, sql, delegate, method, args);
        }
    }
}
