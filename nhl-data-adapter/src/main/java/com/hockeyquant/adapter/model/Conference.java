package com.hockeyquant.adapter.model;

public enum Conference {
    EASTERN,
    WESTERN
}
