package com.astrazeneca.tbltransfer.data;

public enum Strand {
    FORWARD, REVERSE
}
