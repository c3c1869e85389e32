package gov.llnl.ams.jobmanager;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import gov.llnl.ams.store.AbstractDataStore;
import gov.llnl.ams.store.DataStoreException;
import gov.llnl.ams.store.ModelRecord;

/**
 * A store that knows a fixed set of models.
 */
class FixedDataStore extends AbstractDataStore {
	private final List<ModelRecord> models = new ArrayList<>();

	private DataStoreException failure;

	FixedDataStore(File rootPath, ModelRecord... models) {
		super(rootPath);
		for (ModelRecord model : models)
			this.models.add(model);
	}

	void failWith(DataStoreException failure) {
		this.failure = failure;
	}

	@Override
	public List<ModelRecord> search(String domainName, String entry,
			String version) throws DataStoreException {
		if (failure != null)
			throw failure;
		List<ModelRecord> found = new ArrayList<>();
		for (ModelRecord model : models)
			if (model.getDomainName().equals(domainName))
				found.add(model);
		return found;
	}
}
