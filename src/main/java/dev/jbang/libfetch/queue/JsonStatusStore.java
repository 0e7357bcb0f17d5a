package dev.jbang.libfetch.queue;

import dev.jbang.libfetch.util.JsonUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Keeps the work items as a JSON array in a single file */
public class JsonStatusStore implements StatusStore {
	private final Path statusFile;

	public JsonStatusStore(Path statusFile) {
		this.statusFile = statusFile;
	}

	@Override
	public List<WorkItem> load() throws IOException {
		return JsonUtils.readList(statusFile, WorkItem.class);
	}

	@Override
	public void save(List<WorkItem> items) throws IOException {
		JsonUtils.writeAtomically(statusFile, items);
	}

	public Path statusFile() {
		return statusFile;
	}
}
