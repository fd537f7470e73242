package com.example.mlops.collab;

import com.example.mlops.dto.Dataset;
import com.example.mlops.exception.TrainingException;

/**
 * Fits a candidate regression model. The learning algorithm is the implementation's business.
 */
public interface Trainer {

    /**
     * @throws TrainingException if the model could not be fitted
     */
    TrainedModel fit(Dataset dataset);
}
