// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.visibility;

@FunctionalInterface
public interface VisibilityListener {
    void onVisibilityChanged(boolean visible);
}
