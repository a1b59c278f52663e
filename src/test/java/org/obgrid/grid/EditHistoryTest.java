package org.obgrid.grid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

/** Tests {@link EditHistory} */
public class EditHistoryTest {
	private static void edit(EditHistory<TestPerson> history, TestPerson person, ColumnModel<TestPerson, String> column, String value) {
		String old = column.getValue(person);
		column.setValue(person, value);
		history.record(person, column, old, value);
	}

	/** Tests undo and redo of single edits */
	@Test
	public void undoRedo() {
		EditHistory<TestPerson> history = new EditHistory<>(100);
		ColumnModel<TestPerson, String> email = TestPerson.emailColumn();
		TestPerson person = TestPerson.generate(1).get(0);
		assertFalse(history.canUndo());
		assertNull(history.undo());

		edit(history, person, email, "a@example.com");
		edit(history, person, email, "b@example.com");
		assertEquals("Edit Email", history.getUndoDescription());
		assertTrue(history.undo() instanceof EditHistory.CellEdit);
		assertEquals("a@example.com", person.getEmail());
		history.undo();
		assertEquals("user0@example.com", person.getEmail());
		assertFalse(history.canUndo());
		assertTrue(history.canRedo());

		history.redo();
		assertEquals("a@example.com", person.getEmail());

		// A new edit discards the redo stack
		edit(history, person, email, "c@example.com");
		assertFalse(history.canRedo());
		history.undo();
		assertEquals("a@example.com", person.getEmail());
	}

	/** The history forgets its oldest operations beyond its limit */
	@Test
	public void limit() {
		EditHistory<TestPerson> history = new EditHistory<>(2);
		ColumnModel<TestPerson, String> email = TestPerson.emailColumn();
		TestPerson person = TestPerson.generate(1).get(0);
		for (String value : Arrays.asList("a@x", "b@x", "c@x"))
			edit(history, person, email, value);
		assertTrue(history.undo() != null);
		assertTrue(history.undo() != null);
		assertFalse(history.canUndo());
		assertEquals("a@x", person.getEmail());

		EditHistory<TestPerson> none = new EditHistory<>(0);
		edit(none, person, email, "d@x");
		assertFalse(none.canUndo());
	}

	/** Edits recorded in a batch are undone and redone together */
	@Test
	public void batch() {
		EditHistory<TestPerson> history = new EditHistory<>(100);
		ColumnModel<TestPerson, String> email = TestPerson.emailColumn();
		List<TestPerson> people = TestPerson.generate(3);
		history.beginBatch("Fill emails");
		assertTrue(history.isBatching());
		for (TestPerson person : people)
			edit(history, person, email, "same@example.com");
		try {
			history.undo();
			throw new AssertionError("Undid during a batch");
		} catch (IllegalStateException e) {
			// Expected
		}
		EditHistory.Batch batch = history.endBatch();
		assertEquals(3, batch.getOperations().size());
		assertEquals(3, batch.getItems().size());
		assertEquals("Fill emails", history.getUndoDescription());

		history.undo();
		for (int i = 0; i < people.size(); i++)
			assertEquals("user" + i + "@example.com", people.get(i).getEmail());
		history.redo();
		for (TestPerson person : people)
			assertEquals("same@example.com", person.getEmail());

		history.beginBatch("Empty");
		assertNull(history.endBatch());

		history.beginBatch("Abandoned");
		edit(history, people.get(0), email, "gone@example.com");
		history.cancelBatch();
		assertEquals("same@example.com", people.get(0).getEmail());
		assertNull(history.getRedoDescription());
		assertEquals("Fill emails", history.getUndoDescription());
	}
}
