package com.webdoc.core.stage;

import com.webdoc.core.model.DocumentResult;
import com.webdoc.core.model.ProgressEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link StageReporter} that records everything it is given.
 */
class RecordingReporter implements StageReporter {

    final List<ProgressEvent> progress = new CopyOnWriteArrayList<>();
    final List<DocumentResult> results = new CopyOnWriteArrayList<>();
    volatile boolean active = true;

    @Override
    public boolean progress(ProgressEvent event) {
        if (!active) {
            return false;
        }
        progress.add(event);
        return true;
    }

    @Override
    public boolean documentResult(DocumentResult result) {
        results.add(result);
        return true;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    List<String> messages() {
        return progress.stream().map(ProgressEvent::message).toList();
    }

    List<Integer> percents() {
        return progress.stream().map(ProgressEvent::percent).toList();
    }
}
