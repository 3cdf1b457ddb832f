package com.gibi.app.scanner;

import java.io.IOException;

/** ComicInfo.xml presente mas inutilizável (XML malformado ou grande demais). */
public class DescriptorParseException extends IOException {

    public DescriptorParseException(String message) {
        super(message);
    }

    public DescriptorParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
