package io.chainindex.core.storage;

import io.chainindex.core.protocol.HashX;

public record HashXValue(HashX hashX, long value) {}
