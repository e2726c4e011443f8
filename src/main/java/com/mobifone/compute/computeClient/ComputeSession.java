package com.mobifone.compute.computeClient;

import com.mobifone.compute.model.ComputeInstance;
import com.mobifone.compute.operation.LongRunningOperation;

import java.util.List;
import java.util.Map;

/**
 * Provider connection bound to one project, opened per request.
 */
public interface ComputeSession extends AutoCloseable {

    /**
     * Lists every instance of the project, paginating with the given page size.
     *
     * @return scope key (e.g. {@code zones/us-east1-b}) to the instances of that scope, in
     * provider order; scopes without instances may be present with an empty list
     */
    Map<String, List<ComputeInstance>> aggregatedList(int pageSize);

    LongRunningOperation<?> start(String zone, String instanceName);

    LongRunningOperation<?> stop(String zone, String instanceName);

    @Override
    void close();
}
