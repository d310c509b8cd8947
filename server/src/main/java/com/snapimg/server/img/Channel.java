package com.snapimg.server.img;

public enum Channel {
    RED,
    GREEN,
    BLUE
}
