package com.mobifone.compute.common;

public class Constants {
    public interface ENDPOINT {
        String PING               = "/ping";
        String GET_COMPUTE_ENGINE = "/get_compute_engine";
        String SET_STATE          = "/set_state";
    }

    public interface GCE {
        String NAME_SERVICE = "GCE";
    }

    public interface LABEL {
        String INSTANCE_STARTING = "instance starting";
        String INSTANCE_STOPPING = "instance stopping";
    }

    public static final String SET_STATE_RESULT = "status set";
}
