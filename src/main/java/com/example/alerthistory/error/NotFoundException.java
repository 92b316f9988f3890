package com.example.alerthistory.error;

import lombok.Getter;

@Getter
public class NotFoundException extends AlertHistoryException {

    private final String resource;
    private final String id;

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    @Override
    public String getCode() {
        return "not_found";
    }
}
