package com.tyron.snipj.testFramework;

import com.tyron.snipj.core.editor.EditorCore;

/**
 * Base class for editor/document infrastructure tests.
 */
public abstract class BaseEditorTest extends BaseIdeTest {

    @Override
    protected void beforeEach() throws Exception {
        super.beforeEach();
        EditorCore.register(project);
    }
}
