package io.carelink.a2a.client.http.sse;

public abstract class Event {

    public enum Type {
        COMMENT,
        DATA,
    }

    public abstract Type getType();
}
