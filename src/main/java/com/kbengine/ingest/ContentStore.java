package com.kbengine.ingest;

import java.io.IOException;

public interface ContentStore {
    String read(String contentRef) throws IOException;
}
