package org.obgrid.grid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;

/** Tests {@link SortFilterGroupPipeline} */
public class SortFilterGroupPipelineTest {
	private List<TestPerson> thePeople;
	private ColumnSet<TestPerson> theColumns;
	private List<ValueAccessException> theFaults;
	private SortFilterGroupPipeline<TestPerson> thePipeline;

	/** Creates the people, columns and pipeline */
	@Before
	public void setUp() {
		thePeople = TestPerson.generate(500);
		theColumns = TestPerson.columns();
		theFaults = new ArrayList<>();
		thePipeline = new SortFilterGroupPipeline<>(NullOrdering.FIRST, theFaults::add);
	}

	private static String status(TestPerson p) {
		return p.getStatus();
	}

	/** Filters by status and sorts by name, descending */
	@Test
	public void filterAndSort() {
		ViewSequence<TestPerson> view = thePipeline.rebuild(thePeople, theColumns, SortState.of("name", SortDirection.DESCENDING),
			FilterState.NONE.with("status", ColumnFilter.values("Active")), GroupState.NONE);

		List<TestPerson> expected = thePeople.stream().filter(p -> "Active".equals(p.getStatus()))
			.sorted(Comparator.comparing(TestPerson::getName).reversed()).collect(Collectors.toList());
		assertEquals(expected, view.getItems());
		assertEquals(expected.size(), view.getItemCount());
		assertEquals(expected.size(), view.size());
		assertEquals(500, view.getSourceSize());
		for (ViewEntry<TestPerson> entry : view) {
			ViewEntry.Item<TestPerson> item = (ViewEntry.Item<TestPerson>) entry;
			assertSame(thePeople.get(item.getSourceIndex()), item.getItem());
		}
		assertTrue(theFaults.isEmpty());
	}

	/** With no sort, the view is in source order */
	@Test
	public void unsorted() {
		ViewSequence<TestPerson> view = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, FilterState.NONE, GroupState.NONE);
		assertEquals(thePeople, view.getItems());
	}

	/** Sorting is stable, and nulls sort first regardless of direction */
	@Test
	public void stableSortWithNulls() {
		for (SortDirection dir : SortDirection.values()) {
			ViewSequence<TestPerson> view = thePipeline.rebuild(thePeople, theColumns, SortState.of("status", dir), FilterState.NONE,
				GroupState.NONE);
			assertNull(view.getItems().get(0).getStatus());
			for (int i = 1; i < view.size(); i++) {
				ViewEntry.Item<TestPerson> prev = (ViewEntry.Item<TestPerson>) view.get(i - 1);
				ViewEntry.Item<TestPerson> cur = (ViewEntry.Item<TestPerson>) view.get(i);
				String s1 = prev.getItem().getStatus();
				String s2 = cur.getItem().getStatus();
				if (Objects.equals(s1, s2))
					assertTrue("Equal values keep their source order", prev.getSourceIndex() < cur.getSourceIndex());
				else if (s1 != null) {
					assertTrue(s2 != null);
					int comp = s1.compareTo(s2);
					assertTrue(dir == SortDirection.ASCENDING ? comp < 0 : comp > 0);
				}
			}
		}

		SortFilterGroupPipeline<TestPerson> nullsLast = new SortFilterGroupPipeline<>(NullOrdering.LAST, null);
		List<TestPerson> items = nullsLast.rebuild(thePeople, theColumns, SortState.of("status", SortDirection.DESCENDING),
			FilterState.NONE, GroupState.NONE).getItems();
		assertNull(items.get(items.size() - 1).getStatus());
		assertEquals("Pending", items.get(0).getStatus());
	}

	/** Tests sorting by more than one column */
	@Test
	public void multiKeySort() {
		SortState sort = SortState.of("status", SortDirection.ASCENDING).then("age", SortDirection.DESCENDING);
		List<TestPerson> items = thePipeline.rebuild(thePeople, theColumns, sort, FilterState.NONE, GroupState.NONE).getItems();
		Comparator<TestPerson> expectedOrder = Comparator.comparing(SortFilterGroupPipelineTest::status,
			Comparator.nullsFirst(Comparator.<String> naturalOrder()))//
			.thenComparing(Comparator.comparing(TestPerson::getAge).reversed());
		List<TestPerson> expected = new ArrayList<>(thePeople);
		expected.sort(expectedOrder);
		assertEquals(expected, items);
	}

	/** A column's comparator overrides the natural order of its values */
	@Test
	public void comparator() {
		theColumns.add(ColumnModel.<TestPerson, String> build("length", String.class, TestPerson::getName)//
			.withComparator(Comparator.comparingInt(String::length)).build());
		List<TestPerson> items = thePipeline
			.rebuild(thePeople, theColumns, SortState.of("length", SortDirection.ASCENDING), FilterState.NONE, GroupState.NONE)
			.getItems();
		for (int i = 1; i < items.size(); i++)
			assertTrue(items.get(i - 1).getName().length() <= items.get(i).getName().length());
	}

	/** Tests text and predicate filters, which all must pass */
	@Test
	public void filters() {
		FilterState filter = FilterState.NONE.with("name", ColumnFilter.text("LOVE"));
		List<TestPerson> items = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, filter, GroupState.NONE).getItems();
		assertEquals(thePeople.stream().filter(p -> p.getName().contains("Lovelace")).collect(Collectors.toList()), items);
		assertFalse(items.isEmpty());

		filter = filter.with("age", ColumnFilter.predicate(Integer.class, age -> age < 30));
		items = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, filter, GroupState.NONE).getItems();
		assertEquals(thePeople.stream().filter(p -> p.getName().contains("Lovelace") && p.getAge() < 30).collect(Collectors.toList()),
			items);

		// Value filters may select the null value
		filter = FilterState.NONE.with("status", ColumnFilter.values(Arrays.asList(null, "Pending")));
		items = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, filter, GroupState.NONE).getItems();
		assertEquals(thePeople.stream().filter(p -> p.getStatus() == null || p.getStatus().equals("Pending")).collect(Collectors.toList()),
			items);

		// An inactive filter passes everything
		filter = FilterState.NONE.with("name", ColumnFilter.text("  "));
		assertEquals(500, thePipeline.rebuild(thePeople, theColumns, SortState.NONE, filter, GroupState.NONE).size());
	}

	/** Tests grouping, headers and collapsed groups */
	@Test
	public void grouping() {
		ViewSequence<TestPerson> view = thePipeline.rebuild(thePeople, theColumns, SortState.of("age", SortDirection.ASCENDING),
			FilterState.NONE, GroupState.by("status"));
		// Groups appear in the order their keys are first seen in the source
		List<Object> keys = new ArrayList<>();
		List<String> texts = new ArrayList<>();
		for (ViewEntry<TestPerson> entry : view) {
			if (entry.isGroupHeader()) {
				keys.add(((ViewEntry.GroupHeader<TestPerson>) entry).getKey());
				texts.add(((ViewEntry.GroupHeader<TestPerson>) entry).getText());
			}
		}
		assertEquals(Arrays.asList("Active", "Inactive", "Pending", null), keys);
		assertEquals(Arrays.asList("Active", "Inactive", "Pending", FilterCandidate.EMPTY_TEXT), texts);
		assertEquals(500, view.getItemCount());
		assertEquals(504, view.size());

		ViewEntry.GroupHeader<TestPerson> header = (ViewEntry.GroupHeader<TestPerson>) view.get(0);
		long active = thePeople.stream().filter(p -> "Active".equals(p.getStatus())).count();
		assertEquals(active, header.getItemCount());
		assertFalse(header.isCollapsed());
		// Items within a group are sorted
		for (int i = 2; i <= active; i++) {
			assertEquals("Active", view.get(i).getItem().getStatus());
			assertTrue(view.get(i - 1).getItem().getAge() <= view.get(i).getItem().getAge());
		}

		// Collapsed groups keep their header
		ViewSequence<TestPerson> collapsed = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, FilterState.NONE,
			GroupState.by("status").collapse("Inactive").collapse(null));
		long shown = thePeople.stream().filter(p -> "Active".equals(p.getStatus()) || "Pending".equals(p.getStatus())).count();
		assertEquals(shown, collapsed.getItemCount());
		assertEquals(shown + 4, collapsed.size());
		int inactiveHeader = (int) active + 1;
		assertTrue(collapsed.get(inactiveHeader).isGroupHeader());
		assertTrue(((ViewEntry.GroupHeader<TestPerson>) collapsed.get(inactiveHeader)).isCollapsed());
		assertTrue(collapsed.get(inactiveHeader + 1).isGroupHeader());

		// Without headers, the items are simply ordered by group
		ViewSequence<TestPerson> headless = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, FilterState.NONE,
			GroupState.by("status").withHeaders(false));
		assertEquals(500, headless.size());
		assertEquals("Active", headless.get(0).getItem().getStatus());
		assertNull(headless.get(499).getItem().getStatus());
	}

	/** A getter that throws makes the value absent: it passes filters and sorts last */
	@Test
	public void absentValues() {
		theColumns.add(ColumnModel.<TestPerson, Integer> build("risky", Integer.class, p -> {
			if (p.getAge() % 10 == 0)
				throw new IllegalStateException("No value for " + p);
			return p.getAge();
		}).build());
		long faulty = thePeople.stream().filter(p -> p.getAge() % 10 == 0).count();

		for (SortDirection dir : SortDirection.values()) {
			theFaults.clear();
			List<TestPerson> items = thePipeline
				.rebuild(thePeople, theColumns, SortState.of("risky", dir), FilterState.NONE, GroupState.NONE).getItems();
			assertEquals(500, items.size());
			for (int i = 0; i < items.size(); i++)
				assertEquals(i >= 500 - faulty, items.get(i).getAge() % 10 == 0);
			assertEquals(faulty, theFaults.size());
			assertEquals("risky", theFaults.get(0).getColumnId());
		}

		FilterState filter = FilterState.NONE.with("risky", ColumnFilter.predicate(Integer.class, age -> age > 1000));
		List<TestPerson> items = thePipeline.rebuild(thePeople, theColumns, SortState.NONE, filter, GroupState.NONE).getItems();
		assertEquals(faulty, items.size());
	}

	/** Filter candidates ignore the column's own filter, which only determines which candidates are selected */
	@Test
	public void filterCandidates() {
		FilterState filter = FilterState.NONE.with("status", ColumnFilter.values("Active"));
		List<FilterCandidate> candidates = thePipeline.filterCandidates(thePeople, theColumns, filter, "status");
		assertEquals(Arrays.asList(FilterCandidate.EMPTY_TEXT, "Active", "Inactive", "Pending"),
			candidates.stream().map(FilterCandidate::getDisplayText).collect(Collectors.toList()));
		assertNull(candidates.get(0).getValue());
		assertEquals(Arrays.asList(false, true, false, false),
			candidates.stream().map(FilterCandidate::isSelected).collect(Collectors.toList()));
		int total = 0;
		for (FilterCandidate candidate : candidates)
			total += candidate.getCount();
		assertEquals(500, total);

		// Other columns' filters do restrict the candidates
		filter = filter.with("age", ColumnFilter.predicate(Integer.class, age -> age < 22));
		candidates = thePipeline.filterCandidates(thePeople, theColumns, filter, "status");
		total = 0;
		for (FilterCandidate candidate : candidates)
			total += candidate.getCount();
		assertEquals(thePeople.stream().filter(p -> p.getAge() < 22).count(), total);

		// With no filter, everything is selected
		for (FilterCandidate candidate : thePipeline.filterCandidates(thePeople, theColumns, FilterState.NONE, "status"))
			assertTrue(candidate.isSelected());
	}

	private static List<String> counts(List<FilterCandidate> candidates) {
		return candidates.stream().map(c -> c.getDisplayText() + "=" + c.getCount()).collect(Collectors.toList());
	}

	/** A column's own filter never narrows its candidate list, while it does narrow the lists of the other columns */
	@Test
	public void cascadingCandidates() {
		FilterState byAge = FilterState.NONE.with("age", ColumnFilter.predicate(Integer.class, age -> age < 30));
		FilterState byAgeAndStatus = byAge.with("status", ColumnFilter.values("Active"));

		List<FilterCandidate> statusBefore = thePipeline.filterCandidates(thePeople, theColumns, byAge, "status");
		List<FilterCandidate> statusAfter = thePipeline.filterCandidates(thePeople, theColumns, byAgeAndStatus, "status");
		assertEquals(counts(statusBefore), counts(statusAfter));
		assertTrue(statusAfter.size() > 1);
		for (FilterCandidate candidate : statusAfter)
			assertEquals("Active".equals(candidate.getValue()), candidate.isSelected());

		List<FilterCandidate> ageBefore = thePipeline.filterCandidates(thePeople, theColumns, byAge, "age");
		List<FilterCandidate> ageAfter = thePipeline.filterCandidates(thePeople, theColumns, byAgeAndStatus, "age");
		assertFalse(counts(ageBefore).equals(counts(ageAfter)));
		int total = 0;
		for (FilterCandidate candidate : ageAfter)
			total += candidate.getCount();
		assertEquals(thePeople.stream().filter(p -> "Active".equals(p.getStatus())).count(), total);

		// Neither call touched the filter state
		assertEquals(ColumnFilter.values("Active"), byAgeAndStatus.get("status"));
		assertFalse(byAge.isFiltered("status"));
	}
}
