package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.security.SecretMaterial;

public interface RemoteServiceClient {
    JsonNode invoke(RemoteCall call, SecretMaterial credentials) throws RemoteCallException;
}
