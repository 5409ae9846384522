package com.jobprospector.hiring.detection.ats;

import com.jobprospector.hiring.detection.model.AtsPlatform;
import com.jobprospector.hiring.detection.model.PlatformLookup;

public interface AtsBoardClient {
    AtsPlatform platform();

    PlatformLookup fetchBoard(String token);
}
