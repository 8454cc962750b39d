package com.shelfsync.converter.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/** One category a receiver record is filed under, in receiver order. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CategoryRef {
    private String uid;
    private String title;

    public CategoryRef() {}

    public CategoryRef(String uid, String title) {
        this.uid = uid;
        this.title = title;
    }

    public String getUid() { return uid; }
    public void setUid(String uid) { this.uid = uid; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
}
