package org.obgrid.grid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

/** Tests {@link SelectionModel} */
public class SelectionModelTest {
	/** Tests selection in each mode */
	@Test
	public void modes() {
		SelectionModel<String> selection = new SelectionModel<>(SelectionMode.MULTIPLE);
		List<SelectionChangeEvent<String>> events = new ArrayList<>();
		selection.changes().act(events::add);

		assertTrue(selection.select("a"));
		assertTrue(selection.select("b"));
		assertEquals(Arrays.asList("a", "b"), selection.getSelection());
		assertTrue("Selecting again toggles", selection.select("a"));
		assertEquals(Arrays.asList("b"), selection.getSelection());
		assertEquals(Arrays.asList("a"), events.get(2).getRemoved());
		selection.select("c");

		selection.setMode(SelectionMode.SINGLE);
		assertEquals(Arrays.asList("b"), selection.getSelection());
		assertTrue(selection.select("d"));
		assertEquals("d", selection.getSelected());
		assertFalse(selection.setSelected("d", true));
		assertTrue(selection.setSelected("d", false));
		assertNull(selection.getSelected());

		selection.select("e");
		selection.setMode(SelectionMode.NONE);
		assertTrue(selection.getSelection().isEmpty());
		assertFalse(selection.select("f"));
		assertFalse(selection.isSelected("f"));
	}

	/** Tests {@link SelectionModel#retain(java.util.Collection)} */
	@Test
	public void retain() {
		SelectionModel<String> selection = new SelectionModel<>(SelectionMode.MULTIPLE);
		for (String s : Arrays.asList("a", "b", "c", "d"))
			selection.select(s);
		List<SelectionChangeEvent<String>> events = new ArrayList<>();
		selection.changes().act(events::add);
		assertTrue(selection.retain(Arrays.asList("b", "d", "e")));
		assertEquals(Arrays.asList("b", "d"), selection.getSelection());
		assertEquals(Arrays.asList("a", "c"), events.get(0).getRemoved());
		assertFalse(selection.retain(Arrays.asList("b", "d")));
		assertEquals(1, events.size());
	}

	/** Pruning a large selection looks each selected item up in one pass over the source, not by scanning the source per item */
	@Test
	public void retainLarge() {
		int[] scans = new int[1];
		List<Integer> source = new ArrayList<Integer>() {
			@Override
			public boolean contains(Object o) {
				scans[0]++;
				return super.contains(o);
			}
		};
		for (int i = 0; i < 40_000; i++)
			source.add(i);
		SelectionModel<Integer> selection = new SelectionModel<>(SelectionMode.MULTIPLE);
		for (int i = 0; i < 40_000; i += 5)
			assertTrue(selection.select(i));
		assertTrue(selection.isSelected(39_995));
		assertFalse(selection.isSelected(39_996));

		assertFalse(selection.retain(source));
		assertEquals(8_000, selection.getSelection().size());

		source.subList(20_000, 40_000).clear();
		assertTrue(selection.retain(source));
		assertEquals(0, scans[0]);
		assertEquals(4_000, selection.getSelection().size());
		assertEquals(Integer.valueOf(0), selection.getSelected());
		assertEquals(Integer.valueOf(19_995), selection.getSelection().get(3_999));
		assertFalse(selection.isSelected(20_000));
	}
}
