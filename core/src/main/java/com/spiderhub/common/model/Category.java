package com.spiderhub.common.model;

import com.google.gson.annotations.SerializedName;

public record Category(
        @SerializedName("type_id") String typeId,
        @SerializedName("type_name") String typeName) {
}
