package org.obgrid.grid.swing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;

import javax.swing.SwingUtilities;
import javax.swing.event.TableModelEvent;

import org.junit.Test;
import org.obgrid.grid.ColumnFilter;
import org.obgrid.grid.DataGrid;
import org.obgrid.grid.EditResult;
import org.obgrid.grid.FixedWidthMeasurer;
import org.obgrid.grid.GridOptions;
import org.obgrid.grid.TestPerson;

/** Tests {@link GridTableModel} */
public class GridTableModelTest {
	private static DataGrid<TestPerson> createGrid(List<TestPerson> people, GridOptions options) {
		DataGrid<TestPerson> grid = DataGrid.build(people)//
			.withColumns(TestPerson.columns().getAll())//
			.withOptions(options)//
			.withMeasurer(new FixedWidthMeasurer(8))//
			.build();
		grid.setViewport(800, 440);
		return grid;
	}

	/** Runs a test on the event dispatch thread, unwrapping its failure */
	private static void onEDT(Runnable test) throws Throwable {
		try {
			SwingUtilities.invokeAndWait(test);
		} catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	/** Tests the structure and values the model exposes */
	@Test
	public void structure() throws Throwable {
		onEDT(() -> {
			List<TestPerson> people = TestPerson.generate(120);
			DataGrid<TestPerson> grid = createGrid(people, GridOptions.build().withPageSize(50).build());
			GridTableModel<TestPerson> model = new GridTableModel<>(grid);
			assertEquals(50, model.getRowCount());
			assertEquals(4, model.getColumnCount());
			assertEquals("Name", model.getColumnName(0));
			assertEquals(String.class, model.getColumnClass(1));
			assertEquals(Integer.class, model.getColumnClass(3));
			assertEquals(people.get(7).getName(), model.getValueAt(7, 0));
			assertEquals(people.get(7).getAge(), model.getValueAt(7, 3));
			assertFalse(model.isCellEditable(0, 0));
			assertTrue(model.isCellEditable(0, 1));

			grid.toggleSort("name");
			assertEquals("Name ▲", model.getColumnName(0));
			grid.toggleSort("name");
			assertEquals("Name ▼", model.getColumnName(0));

			grid.lastPage();
			assertEquals(20, model.getRowCount());
			model.dispose();
		});
	}

	/** The model follows the grid's changes, firing events to its listeners */
	@Test
	public void events() throws Throwable {
		onEDT(() -> {
			List<TestPerson> people = TestPerson.generate(60);
			DataGrid<TestPerson> grid = createGrid(people, GridOptions.DEFAULT);
			GridTableModel<TestPerson> model = new GridTableModel<>(grid);
			List<TableModelEvent> events = new ArrayList<>();
			model.addTableModelListener(events::add);

			grid.setFilter("status", ColumnFilter.values("Pending"));
			assertFalse(events.isEmpty());
			assertEquals(people.stream().filter(p -> "Pending".equals(p.getStatus())).count(), model.getRowCount());

			events.clear();
			grid.setColumnVisible("email", false);
			assertEquals(3, model.getColumnCount());
			assertEquals("Status", model.getColumnName(1));
			assertTrue(events.stream().anyMatch(evt -> evt.getFirstRow() == TableModelEvent.HEADER_ROW));

			grid.clearFilters();
			grid.groupBy("status");
			long active = people.stream().filter(p -> "Active".equals(p.getStatus())).count();
			assertEquals("- Active (" + active + ")", model.getValueAt(0, 0));
			assertNull(model.getValueAt(0, 1));
			assertFalse(model.isCellEditable(0, 2));
			model.dispose();

			events.clear();
			grid.groupBy(null);
			assertTrue("A disposed model does not listen", events.isEmpty());
		});
	}

	/** Edits through the model are validated by the grid */
	@Test
	public void edits() throws Throwable {
		onEDT(() -> {
			List<TestPerson> people = TestPerson.generate(100);
			DataGrid<TestPerson> grid = createGrid(people, GridOptions.DEFAULT);
			GridTableModel<TestPerson> model = new GridTableModel<>(grid);

			model.setValueAt("table@example.com", 2, 1);
			assertTrue(model.getLastEditResult().isCommitted());
			assertEquals("table@example.com", people.get(2).getEmail());
			assertTrue(grid.canUndo());

			model.setValueAt("nonsense", 2, 1);
			assertEquals(EditResult.Kind.INVALID, model.getLastEditResult().getKind());
			assertEquals("table@example.com", people.get(2).getEmail());
			assertFalse(grid.getEditController().isEditing());

			// Rows outside the viewport are scrolled into view to be edited
			model.setValueAt(Integer.valueOf(90), 80, 3);
			assertTrue(model.getLastEditResult().isCommitted());
			assertEquals(Integer.valueOf(90), people.get(80).getAge());

			model.setValueAt("read-only", 3, 0);
			assertNull(model.getLastEditResult());
			assertEquals(people.get(3).getName(), model.getValueAt(3, 0));
		});
	}
}
