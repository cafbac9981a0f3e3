module io.github.cyfko.keyflat.core {
    requires java.logging;

    exports io.github.cyfko.keyflat.core;
    exports io.github.cyfko.keyflat.core.api;
    exports io.github.cyfko.keyflat.core.config;
    exports io.github.cyfko.keyflat.core.exception;
    exports io.github.cyfko.keyflat.core.parsing;
    exports io.github.cyfko.keyflat.core.utils;
}
