package fr.lapetina.embedding.accelerator.dispatch;

import java.util.List;

/**
 * Work applied to one batch. Must return exactly one result per input, in input order.
 */
@FunctionalInterface
public interface BatchFunction<T, R> {

    List<R> apply(List<T> batch) throws Exception;
}
