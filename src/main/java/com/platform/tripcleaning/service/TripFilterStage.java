package com.platform.tripcleaning.service;

import com.platform.tripcleaning.domain.TripRecord;

import java.util.List;

/**
 * A pipeline step that keeps a subset of its input. Implementations never mutate the input list.
 */
public interface TripFilterStage {

    String name();

    StageResult apply(List<TripRecord> input);
}
