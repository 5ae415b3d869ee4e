package net.jobledger.core.spi;

import java.util.concurrent.Callable;

public interface TxRunner {
    /** Joins the transaction bound to the current thread, or opens one. */
    <T> T required(Callable<T> body) throws Exception;

    /** Always runs in its own transaction, committed before returning. */
    <T> T requiresNew(Callable<T> body) throws Exception;

    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }
}
