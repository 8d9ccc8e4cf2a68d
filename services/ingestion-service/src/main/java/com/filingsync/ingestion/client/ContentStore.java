package com.filingsync.ingestion.client;

import com.filingsync.ingestion.domain.ContentLocation;

public interface ContentStore {

    ContentLocation put(String documentIdentity, byte[] bytes);
}
