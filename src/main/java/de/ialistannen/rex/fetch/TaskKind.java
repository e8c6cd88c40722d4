package de.ialistannen.rex.fetch;

public enum TaskKind {
  TAG_METADATA,
  REPOSITORY_METADATA,
  TAG_LIST
}
