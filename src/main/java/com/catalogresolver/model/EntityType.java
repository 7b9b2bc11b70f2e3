package com.catalogresolver.model;

public enum EntityType {
    TRACK,
    ALBUM,
    PLAYLIST,
    ARTIST
}
