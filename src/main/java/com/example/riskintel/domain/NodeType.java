package com.example.riskintel.domain;

public enum NodeType {
    SERVICE,
    ASSET
}
