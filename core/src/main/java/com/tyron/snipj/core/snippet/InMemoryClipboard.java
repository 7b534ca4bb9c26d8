package com.tyron.snipj.core.snippet;

import com.tyron.snipj.api.snippet.Clipboard;
import org.jetbrains.annotations.Nullable;

/**
 * Default application clipboard; holds the last copied text in memory.
 */
public final class InMemoryClipboard implements Clipboard {

    private volatile String contents;

    @Nullable
    @Override
    public String getContents() {
        return contents;
    }

    @Override
    public void setContents(@Nullable String text) {
        this.contents = text;
    }
}
