package com.tyron.snipj.api.snippet;

import org.jetbrains.annotations.Nullable;

/**
 * Application-wide clipboard, read by the {@code CLIPBOARD} snippet variable.
 */
public interface Clipboard {

    @Nullable
    String getContents();

    void setContents(@Nullable String text);
}
