package com.autotask.simpleSDK.http.auth;

import java.util.Map;

public interface AutotaskCredentials {
    Map<String, String> getAuthenticationHeaders();

    String getUsername();
}
