package de.ialistannen.rex.fetch;

/**
 * @param item the name of the item that could not be fetched
 * @param error why it failed
 */
public record FetchFailure(String item, Exception error) {

}
