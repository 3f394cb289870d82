package com.kmg.receipts.service.routing;

import com.kmg.receipts.model.ModelDefinition;

public class AdmissionDeniedException extends RuntimeException {
    private final ModelDefinition model;

    public AdmissionDeniedException(ModelDefinition model) {
        super("Admission denied for provider " + model.provider() + " (model " + model.id() + ")");
        this.model = model;
    }

    public ModelDefinition model() {
        return model;
    }

    public String provider() {
        return model.provider();
    }
}
