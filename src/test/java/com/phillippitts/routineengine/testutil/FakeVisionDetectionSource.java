package com.phillippitts.routineengine.testutil;

import com.phillippitts.routineengine.service.vision.Detection;
import com.phillippitts.routineengine.service.vision.VisionDetectionRequest;
import com.phillippitts.routineengine.service.vision.VisionDetectionSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link VisionDetectionSource} returning whatever detections the test sets next.
 */
public class FakeVisionDetectionSource implements VisionDetectionSource {

    private final String service;
    private final List<VisionDetectionRequest> requests = new CopyOnWriteArrayList<>();
    private volatile List<Detection> next = List.of();
    private volatile RuntimeException failure;

    public FakeVisionDetectionSource(String service) {
        this.service = service;
    }

    public FakeVisionDetectionSource returning(Detection... detections) {
        this.next = List.of(detections);
        this.failure = null;
        return this;
    }

    public FakeVisionDetectionSource failing(RuntimeException failure) {
        this.failure = failure;
        return this;
    }

    public List<VisionDetectionRequest> requests() {
        return new ArrayList<>(requests);
    }

    @Override
    public String service() {
        return service;
    }

    @Override
    public List<Detection> detect(VisionDetectionRequest request) {
        requests.add(request);
        if (failure != null) {
            throw failure;
        }
        return next;
    }
}
