package com.killfeed.engine.domain.repository;

import com.killfeed.engine.domain.model.EventQuery;
import com.killfeed.engine.domain.model.StoredEventRecord;

import java.util.List;

public interface StoredEventSearchRepository {

    List<StoredEventRecord> search(EventQuery query);

    long countMatching(EventQuery query);
}
