package com.gibi.app.watch;

import java.nio.file.Path;

/** Decide se um DELETE e um CREATE do mesmo lote são, na verdade, um rename. */
@FunctionalInterface
public interface MoveMatcher {
    boolean matches(Path deleted, Path created);
}
