package com.kmg.receipts.service.routing;

import com.kmg.receipts.model.ModelDefinition;

/**
 * Consulted by the router around every provider call, fallback calls included.
 */
public interface DispatchGate {

    boolean admit(ModelDefinition model);

    void settle(ModelDefinition model, long tokensUsed);
}
