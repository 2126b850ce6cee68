package io.planbridge.core.render;

import io.planbridge.core.diff.DiffKind;

/** Per-path change kind as exchanged with the deployment engine. */
public enum WireKind {
    ADD,
    ADD_REPLACE,
    DELETE,
    DELETE_REPLACE,
    UPDATE,
    UPDATE_REPLACE;

    public static WireKind of(DiffKind kind, boolean replace) {
        return switch (kind) {
            case ADD -> replace ? ADD_REPLACE : ADD;
            case DELETE -> replace ? DELETE_REPLACE : DELETE;
            case UPDATE -> replace ? UPDATE_REPLACE : UPDATE;
        };
    }

    public boolean isReplace() {
        return this == ADD_REPLACE || this == DELETE_REPLACE || this == UPDATE_REPLACE;
    }
}
