package com.ytarchive.recovery;

/**
 * One downstream call wrapped by {@link ErrorRecoveryManager}. May throw whatever the collaborator
 * throws; blocking implementations should respond to thread interruption.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface RecoverableOperation<T> {

    T call() throws Exception;
}
