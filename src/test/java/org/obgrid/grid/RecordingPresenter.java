package org.obgrid.grid;

import java.util.ArrayList;
import java.util.List;

/** A {@link RowPresenter} that counts its callbacks */
public class RecordingPresenter<R> implements RowPresenter<R> {
	int created;
	int bound;
	int unbound;
	int cellsChanged;
	int widthsChanged;
	int layouts;
	int disposed;
	final List<Object> visuals = new ArrayList<>();

	@Override
	public Object create(RowContainer<R> container) {
		created++;
		Object visual = new Object();
		visuals.add(visual);
		return visual;
	}

	@Override
	public void bound(RowContainer<R> container) {
		bound++;
	}

	@Override
	public void unbound(RowContainer<R> container) {
		unbound++;
	}

	@Override
	public void cellChanged(RowContainer<R> container, String columnId) {
		cellsChanged++;
	}

	@Override
	public void widthsChanged(RowContainer<R> container) {
		widthsChanged++;
	}

	@Override
	public void layout(List<RowContainer<R>> rows) {
		layouts++;
	}

	@Override
	public void disposed(RowContainer<R> container) {
		disposed++;
	}
}
