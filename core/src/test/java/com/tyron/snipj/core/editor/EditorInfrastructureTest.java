package com.tyron.snipj.core.editor;

import com.tyron.snipj.api.editor.Document;
import com.tyron.snipj.api.editor.DocumentEvent;
import com.tyron.snipj.api.editor.Editor;
import com.tyron.snipj.api.editor.EditorManager;
import com.tyron.snipj.api.editor.FileDocumentManager;
import com.tyron.snipj.core.editor.document.InMemoryDocument;
import com.tyron.snipj.testFramework.BaseEditorTest;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EditorInfrastructureTest extends BaseEditorTest {

    @Test
    public void editsStayInMemoryUntilCommit() throws Exception {
        Path javaFile = file("Main.java", "class Main {}\n");

        FileDocumentManager fdm = FileDocumentManagerImpl.getInstance(project);
        EditorManager em = EditorManagerImpl.getInstance(project);

        Document doc = fdm.getDocument(javaFile);
        assertEquals("class Main {}\n", doc.getText());
        assertFalse(fdm.isModified(doc));
        assertSame(doc, fdm.getDocument(javaFile));

        // Edit in memory.
        doc.replace(0, doc.getTextLength(), "class Main { int x; }\n");
        assertTrue(fdm.isModified(doc));

        // Disk content unchanged.
        assertEquals("class Main {}\n", Files.readString(javaFile));

        // Commit persists.
        fdm.commitDocument(doc);
        assertFalse(fdm.isModified(doc));
        assertEquals("class Main { int x; }\n", Files.readString(javaFile));

        // Editor lifecycle.
        Editor editor = em.openEditor(javaFile);
        assertSame(doc, editor.getDocument());
        assertEquals(1, em.getEditors(doc).size());
        em.focusEditor(editor);
        assertSame(editor, em.getFocusedEditor());
        em.releaseEditor(editor);
        assertEquals(0, em.getEditors(doc).size());
        assertNull(em.getFocusedEditor());
    }

    @Test
    public void documentEventsDescribeChange() {
        InMemoryDocument doc = new InMemoryDocument("hello");
        List<DocumentEvent> events = new ArrayList<>();
        doc.addDocumentListener(events::add);
        long stamp = doc.getModificationStamp();

        doc.replace(1, 3, "EY");
        doc.insertString(0, "");
        doc.deleteString(4, 5);

        assertEquals("hEYl", doc.getText());
        assertEquals(2, events.size());
        assertEquals(1, events.get(0).getStartOffset());
        assertEquals(3, events.get(0).getEndOffset());
        assertEquals("EY", events.get(0).getNewText());
        assertEquals(-1, events.get(1).getDelta());
        assertEquals(stamp + 2, doc.getModificationStamp());
        assertThrows(IndexOutOfBoundsException.class, () -> doc.replace(3, 9, "x"));
    }

    @Test
    public void caretAndSelectionFollowEdits() {
        InMemoryDocument doc = new InMemoryDocument("0123456789");
        SimpleEditor editor = new SimpleEditor(doc);
        List<Integer> moves = new ArrayList<>();
        editor.getCaretModel().addCaretListener((e, oldOffset, newOffset) -> moves.add(newOffset));

        editor.getSelectionModel().setSelection(4, 6);
        assertEquals(6, editor.getCaretModel().getOffset());

        doc.insertString(0, "ab");
        assertEquals(6, editor.getSelectionModel().getSelectionStart());
        assertEquals(8, editor.getSelectionModel().getSelectionEnd());
        assertEquals(8, editor.getCaretModel().getOffset());

        doc.deleteString(5, 10);
        assertFalse(editor.getSelectionModel().hasSelection());
        assertEquals(5, editor.getCaretModel().getOffset());

        // Only the explicit move is reported.
        assertEquals(List.of(6), moves);

        editor.dispose();
        doc.insertString(0, "x");
        assertEquals(5, editor.getCaretModel().getOffset());
    }
}
