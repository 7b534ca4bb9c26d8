package com.tyron.snipj.api.completion;

import org.jetbrains.annotations.Nullable;

/**
 * Rendering data for a completion item, kept apart from the UI toolkit.
 * <pre>
 * [Icon]  Name(TailText)       Type
 * [S]     fori                 Snippet
 * </pre>
 */
public class LookupElementPresentation {

    private String itemText;
    private boolean itemTextBold;
    private String tailText;
    private String typeText;
    private String iconKey;

    private boolean frozen;

    @Nullable
    public String getItemText() { return itemText; }
    public boolean isItemTextBold() { return itemTextBold; }
    @Nullable
    public String getTailText() { return tailText; }
    @Nullable
    public String getTypeText() { return typeText; }
    @Nullable
    public String getIconKey() { return iconKey; }

    public void setItemText(@Nullable String text) {
        checkMutable();
        this.itemText = text;
    }

    public void setItemTextBold(boolean bold) {
        checkMutable();
        this.itemTextBold = bold;
    }

    public void setTailText(@Nullable String text) {
        checkMutable();
        this.tailText = text;
    }

    public void setTypeText(@Nullable String text) {
        checkMutable();
        this.typeText = text;
    }

    public void setIconKey(@Nullable String iconKey) {
        checkMutable();
        this.iconKey = iconKey;
    }

    /**
     * Called by the UI after the render pass is complete to prevent tampering.
     */
    public void freeze() {
        this.frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("LookupElementPresentation is frozen and cannot be modified.");
        }
    }
}
