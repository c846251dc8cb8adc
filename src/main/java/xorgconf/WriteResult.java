package xorgconf;

public enum WriteResult {
    WRITTEN,
    NOTHING_TO_WRITE
}
