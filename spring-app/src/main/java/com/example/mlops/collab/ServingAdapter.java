package com.example.mlops.collab;

import com.example.mlops.dto.FeatureVector;
import com.example.mlops.exception.SwapException;
import com.example.mlops.registry.ModelVersion;

import java.util.List;

/**
 * Boundary to the component that serves live inference traffic.
 */
public interface ServingAdapter {

    /** Up to {@code n} of the most recent inference inputs. */
    List<FeatureVector> sampleRecentInputs(int n);

    /**
     * Route new inference traffic to {@code version}.
     *
     * @throws SwapException if the serving side refuses the activation
     */
    void activate(ModelVersion version);
}
