package com.svarx.inference;

import java.nio.file.Path;

public interface ModelLoader {
    InferenceEngine load(Path modelPath, ModelProfile profile) throws InferenceException;
}
