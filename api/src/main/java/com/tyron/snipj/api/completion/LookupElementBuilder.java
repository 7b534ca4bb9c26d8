package com.tyron.snipj.api.completion;

import java.util.Objects;

/**
 * A standard, generic implementation of {@link LookupElement} that uses a builder pattern.
 * <p>
 * On insertion the typed prefix is replaced by the lookup string, then the {@link InsertHandler}, if any, runs.
 * </p>
 */
public final class LookupElementBuilder extends LookupElement {

    private final String lookupString;
    private String itemText;        // The main text shown (defaults to lookupString)
    private String typeText;        // The right-aligned gray text (e.g. "Snippet")
    private String tailText;        // Text right after the main text
    private String iconKey;

    private boolean isBold;

    private InsertHandler<LookupElement> insertHandler;

    public static LookupElementBuilder create(String lookupString) {
        return new LookupElementBuilder(lookupString, lookupString);
    }

    public static LookupElementBuilder create(Object object, String lookupString) {
        return new LookupElementBuilder(object, lookupString);
    }

    private LookupElementBuilder(Object object, String lookupString) {
        super(object);
        this.lookupString = Objects.requireNonNull(lookupString);
        this.itemText = lookupString;
    }

    /**
     * Sets the text displayed in the list. Defaults to the lookup string.
     */
    public LookupElementBuilder withPresentableText(String text) {
        this.itemText = text;
        return this;
    }

    public LookupElementBuilder withTypeText(String typeText) {
        this.typeText = typeText;
        return this;
    }

    public LookupElementBuilder withTailText(String tailText) {
        this.tailText = tailText;
        return this;
    }

    public LookupElementBuilder withIcon(String iconKey) {
        this.iconKey = iconKey;
        return this;
    }

    public LookupElementBuilder withBoldness(boolean bold) {
        this.isBold = bold;
        return this;
    }

    /**
     * Sets sorting priority for this item.
     * Higher values appear earlier.
     */
    public LookupElementBuilder withPriority(int priority) {
        setPriority(priority);
        return this;
    }

    /**
     * Sets a custom handler for insertion events.
     */
    public LookupElementBuilder withInsertHandler(InsertHandler<LookupElement> handler) {
        this.insertHandler = handler;
        return this;
    }

    @Override
    public String getLookupString() {
        return lookupString;
    }

    @Override
    public void renderElement(LookupElementPresentation p) {
        p.setItemText(itemText);
        p.setItemTextBold(isBold);
        p.setIconKey(iconKey);
        p.setTailText(tailText);
        p.setTypeText(typeText);
    }

    @Override
    public void handleInsert(InsertionContext context) {
        context.getDocument().replace(context.getStartOffset(), context.getTailOffset(), lookupString);
        context.setTailOffset(context.getStartOffset() + lookupString.length());

        if (insertHandler != null) {
            insertHandler.handleInsert(context, this);
        }
    }

    @Override
    public String toString() {
        return itemText;
    }
}
