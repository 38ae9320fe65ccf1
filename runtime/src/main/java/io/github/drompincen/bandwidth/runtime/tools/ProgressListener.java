package io.github.drompincen.bandwidth.runtime.tools;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message) -> {};

    void progress(int percent, String message);
}
