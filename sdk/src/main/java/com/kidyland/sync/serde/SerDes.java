// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.kidyland.sync.serde;

import com.kidyland.sync.TypeToken;

/** Decodes response bodies into payload objects. */
public interface SerDes {
    <T> T deserialize(String data, TypeToken<T> typeToken);
}
