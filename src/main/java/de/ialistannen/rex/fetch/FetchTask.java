package de.ialistannen.rex.fetch;

/**
 * A unit of work in a batch.
 *
 * @param position the index of the item in the input, results are reported in this order
 * @param target the item to fetch
 * @param group tasks of the same group stop once one of them was denied access, usually the repository
 * @param kind what the task fetches
 * @param <I> the type of the item
 */
public record FetchTask<I>(int position, I target, String group, TaskKind kind) {

}
