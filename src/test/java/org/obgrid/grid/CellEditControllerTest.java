package org.obgrid.grid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Before;
import org.junit.Test;

/** Tests {@link CellEditController} */
public class CellEditControllerTest {
	private ColumnSet<TestPerson> theColumns;
	private RecordingPresenter<TestPerson> thePresenter;
	private List<TestPerson> thePeople;
	private RowVirtualizer<TestPerson> theVirtualizer;
	private CellEditController<TestPerson> theController;
	private List<EditCommitEvent<TestPerson>> theCommits;
	private List<EditCancelEvent<TestPerson>> theCancels;

	/** Creates the columns and people */
	@Before
	public void setUp() {
		theColumns = TestPerson.columns();
		thePresenter = new RecordingPresenter<>();
		thePeople = TestPerson.generate(50);
	}

	private CellEditController<TestPerson> start() {
		ColumnLayoutEngine<TestPerson> layout = new ColumnLayoutEngine<>(new FixedWidthMeasurer(8), ThemeProvider.DEFAULT, 16);
		theVirtualizer = new RowVirtualizer<>(theColumns, layout, thePresenter, 44, 5, true, null);
		theVirtualizer.setSequence(RowVirtualizerTest.sequence(thePeople), true);
		theVirtualizer.onViewportChanged(0, 440);
		theController = new CellEditController<>(theColumns, theVirtualizer, null);
		theCommits = new ArrayList<>();
		theCancels = new ArrayList<>();
		theController.commits().act(theCommits::add);
		theController.cancels().act(theCancels::add);
		return theController;
	}

	/** Tests a simple successful edit */
	@Test
	public void commit() {
		start();
		assertEquals(EditState.IDLE, theController.getState());
		assertTrue(theController.beginEdit(3, "email"));
		assertEquals(EditState.EDITING, theController.getState());
		EditSession<TestPerson> session = theController.getSession();
		assertEquals(3, session.getRowIndex());
		assertSame(thePeople.get(3), session.getItem());
		assertEquals("user3@example.com", session.getOriginalValue());
		assertEquals("user3@example.com", session.getPendingValue());

		assertTrue(theController.setPendingValue("ada@example.com"));
		EditResult result = theController.commit();
		assertTrue(result.isCommitted());
		assertEquals("ada@example.com", thePeople.get(3).getEmail());
		assertEquals(EditState.IDLE, theController.getState());
		assertNull(theController.getSession());

		assertEquals(1, theCommits.size());
		EditCommitEvent<TestPerson> evt = theCommits.get(0);
		assertSame(thePeople.get(3), evt.getItem());
		assertEquals("email", evt.getColumn().getId());
		assertEquals("user3@example.com", evt.getOldValue());
		assertEquals("ada@example.com", evt.getNewValue());

		assertEquals(EditResult.Kind.NO_SESSION, theController.commit().getKind());
		assertFalse(theController.setPendingValue("x@y"));
	}

	/** Tests the conditions under which an edit is refused */
	@Test
	public void refusals() {
		start();
		assertFalse("Read-only column", theController.beginEdit(3, "name"));
		assertFalse("Row not in the window", theController.beginEdit(30, "email"));
		assertEquals(EditState.IDLE, theController.getState());

		theController.setReadOnly(true);
		assertFalse("Grid is read-only", theController.beginEdit(3, "email"));
		theController.setReadOnly(false);

		theColumns.get("email").setVisible(false);
		assertFalse("Hidden column", theController.beginEdit(3, "email"));
		theColumns.get("email").setVisible(true);
		assertTrue(theController.beginEdit(3, "email"));

		try {
			theController.beginEdit(3, "nothing");
			throw new AssertionError("Edit opened on a missing column");
		} catch (NoSuchElementException e) {
			// Expected
		}
	}

	/** Group headers cannot be edited */
	@Test
	public void groupHeaderRefused() {
		start();
		List<ViewEntry<TestPerson>> seq = new ArrayList<>(RowVirtualizerTest.sequence(thePeople));
		seq.add(0, new ViewEntry.GroupHeader<>("status", "Active", "Active", 50, false));
		theVirtualizer.setSequence(seq, true);
		assertTrue(theVirtualizer.getContainer(0).getEntry().isGroupHeader());
		assertFalse(theController.beginEdit(0, "email"));
		assertTrue(theController.beginEdit(1, "email"));
		assertSame(thePeople.get(0), theController.getSession().getItem());
	}

	/** Values rejected by the column's validator or type leave the session open and the item untouched */
	@Test
	public void invalid() {
		start();
		assertTrue(theController.beginEdit(3, "email"));
		theController.setPendingValue("not an address");
		EditResult result = theController.commit();
		assertEquals(EditResult.Kind.INVALID, result.getKind());
		assertEquals("Not an email address", result.getMessage());
		assertEquals(EditState.EDITING, theController.getState());
		assertEquals("user3@example.com", thePeople.get(3).getEmail());

		theController.setPendingValue(Integer.valueOf(5));
		result = theController.commit();
		assertEquals(EditResult.Kind.INVALID, result.getKind());
		assertTrue(result.getMessage(), result.getMessage().contains("not a valid"));
		assertTrue(theCommits.isEmpty());

		theController.setPendingValue("fixed@example.com");
		assertTrue(theController.commit().isCommitted());
		assertEquals("fixed@example.com", thePeople.get(3).getEmail());
	}

	/** A setter that throws leaves the session open */
	@Test
	public void setterFault() {
		theColumns.add(ColumnModel.<TestPerson, String> build("locked", String.class, TestPerson::getStatus)//
			.mutateAttribute((p, v) -> {
				throw new IllegalStateException("Locked");
			}).build());
		start();
		assertTrue(theController.beginEdit(2, "locked"));
		theController.setPendingValue("Active");
		EditResult result = theController.commit();
		assertEquals(EditResult.Kind.FAULT, result.getKind());
		assertEquals("Locked", result.getFault().getMessage());
		assertEquals(EditState.EDITING, theController.getState());
		assertTrue(theController.isEditing());
		assertTrue(theCommits.isEmpty());
	}

	/** A validator that throws fails the commit without leaving the controller stuck mid-commit */
	@Test
	public void validatorFault() {
		theColumns.add(ColumnModel.<TestPerson, String> build("nick", String.class, TestPerson::getStatus)//
			.mutateAttribute(TestPerson::setStatus)//
			.filterAccept((p, v) -> {
				throw new IllegalStateException("Broken validator");
			}).build());
		start();
		String status = thePeople.get(3).getStatus();
		assertTrue(theController.beginEdit(3, "nick"));
		theController.setPendingValue("Pending");
		EditResult result = theController.commit();
		assertEquals(EditResult.Kind.FAULT, result.getKind());
		assertEquals("Broken validator", result.getFault().getMessage());
		assertEquals(EditState.EDITING, theController.getState());
		assertEquals(status, thePeople.get(3).getStatus());
		assertTrue(theCommits.isEmpty());

		// Opening another edit retries the commit, which fails again, so the new edit is refused
		assertFalse(theController.beginEdit(4, "email"));
		assertEquals(EditState.EDITING, theController.getState());

		assertTrue(theController.cancel());
		assertTrue(theController.beginEdit(4, "email"));
		assertEquals(EditState.EDITING, theController.getState());
	}

	/** Cancelling restores the cell's display and writes nothing */
	@Test
	public void cancel() {
		start();
		EditState[] stateDuringCancel = new EditState[1];
		theController.cancels().act(evt -> stateDuringCancel[0] = theController.getState());
		assertTrue(theController.beginEdit(3, "email"));
		theController.setPendingValue("draft@example.com");
		int cellChanges = thePresenter.cellsChanged;
		assertTrue(theController.cancel());

		assertEquals("user3@example.com", thePeople.get(3).getEmail());
		assertEquals("user3@example.com", theVirtualizer.getContainer(3).getCellText("email"));
		assertEquals(cellChanges + 1, thePresenter.cellsChanged);
		assertEquals(1, theCancels.size());
		assertFalse(theCancels.get(0).isForced());
		assertEquals(EditState.CANCELLED, stateDuringCancel[0]);
		assertEquals(EditState.IDLE, theController.getState());
		assertFalse(theController.cancel());
	}

	/** Scrolling the edited row out of the window discards the edit */
	@Test
	public void forcedCancelOnScroll() {
		start();
		assertTrue(theController.beginEdit(3, "email"));
		theController.setPendingValue("lost@example.com");
		theVirtualizer.scrollTo(1760);
		assertFalse(theController.isEditing());
		assertEquals(1, theCancels.size());
		assertTrue(theCancels.get(0).isForced());
		assertEquals(EditResult.Kind.NO_SESSION, theController.commit().getKind());
		assertEquals("user3@example.com", thePeople.get(3).getEmail());
	}

	/** Re-binding the edited container to the same item keeps the edit, re-binding it to another item discards it */
	@Test
	public void rebind() {
		start();
		assertTrue(theController.beginEdit(3, "email"));
		theVirtualizer.setSequence(RowVirtualizerTest.sequence(thePeople), false);
		assertTrue(theController.isEditing());
		theVirtualizer.refreshAll();
		assertTrue(theController.isEditing());

		List<TestPerson> reversed = new ArrayList<>(thePeople);
		Collections.reverse(reversed);
		theVirtualizer.setSequence(RowVirtualizerTest.sequence(reversed), false);
		assertFalse(theController.isEditing());
		assertTrue(theCancels.get(0).isForced());
	}

	/** Opening an edit while another is open commits the first */
	@Test
	public void commitThenOpen() {
		start();
		assertTrue(theController.beginEdit(3, "email"));
		theController.setPendingValue("first@example.com");
		assertTrue(theController.beginEdit(4, "age"));
		assertEquals("first@example.com", thePeople.get(3).getEmail());
		assertEquals(4, theController.getSession().getRowIndex());
		assertEquals("age", theController.getSession().getColumnId());

		// If the open edit cannot be committed, the new one is refused
		theController.setPendingValue("old");
		assertFalse(theController.beginEdit(5, "email"));
		assertEquals(4, theController.getSession().getRowIndex());
		assertEquals(EditState.EDITING, theController.getState());
		assertEquals(1, theCommits.size());

		// Re-opening the same cell keeps the pending value
		assertTrue(theController.beginEdit(4, "age"));
		assertEquals("old", theController.getSession().getPendingValue());
	}

	/** Tests {@link CellEditController#focusMoved(int, String)} */
	@Test
	public void focusMoved() {
		start();
		assertEquals(EditResult.Kind.NO_SESSION, theController.focusMoved(0, "email").getKind());
		assertTrue(theController.beginEdit(3, "email"));
		theController.setPendingValue("focus@example.com");
		assertNull(theController.focusMoved(3, "email"));
		assertTrue(theController.isEditing());
		assertTrue(theController.focusMoved(3, "age").isCommitted());
		assertEquals("focus@example.com", thePeople.get(3).getEmail());
		assertFalse(theController.isEditing());
	}

	/** Opening an edit from within a commit is a programming error, not a fault */
	@Test(expected = GridInvariantException.class)
	public void reentrantEdit() {
		List<CellEditController<TestPerson>> controller = new ArrayList<>();
		theColumns.add(ColumnModel.<TestPerson, String> build("nested", String.class, TestPerson::getStatus)//
			.mutateAttribute((p, v) -> controller.get(0).beginEdit(4, "email")).build());
		controller.add(start());
		assertTrue(theController.beginEdit(3, "nested"));
		theController.setPendingValue("Pending");
		theController.commit();
	}

	/** Disposing the controller discards any open edit */
	@Test
	public void dispose() {
		start();
		assertTrue(theController.beginEdit(3, "email"));
		theController.dispose();
		assertFalse(theController.isEditing());
		assertTrue(theCancels.get(0).isForced());
		theVirtualizer.scrollTo(1760);
		assertEquals(1, theCancels.size());
	}
}
