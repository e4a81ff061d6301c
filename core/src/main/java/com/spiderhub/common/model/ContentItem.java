package com.spiderhub.common.model;

import com.google.gson.annotations.SerializedName;

/**
 * One VOD entry in the common content model. Field names follow the
 * {@code vod_*} JSON convention shared by rule, script and module parsers.
 */
public class ContentItem {
    @SerializedName("vod_id")
    private String id;
    @SerializedName("vod_name")
    private String name;
    @SerializedName("vod_pic")
    private String pic;
    @SerializedName("vod_remarks")
    private String remarks;
    @SerializedName("type_id")
    private String typeId;
    @SerializedName("type_name")
    private String typeName;

    // Detail fields
    @SerializedName("vod_year")
    private String year;
    @SerializedName("vod_area")
    private String area;
    @SerializedName("vod_actor")
    private String actor;
    @SerializedName("vod_director")
    private String director;
    @SerializedName("vod_content")
    private String content;
    @SerializedName("vod_play_from")
    private String playFrom;
    @SerializedName("vod_play_url")
    private String playUrl;

    public ContentItem() {
    }

    public ContentItem(String id, String name, String pic, String remarks) {
        this.id = id;
        this.name = name;
        this.pic = pic;
        this.remarks = remarks;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getPic() { return pic; }
    public void setPic(String pic) { this.pic = pic; }

    public String getRemarks() { return remarks; }
    public void setRemarks(String remarks) { this.remarks = remarks; }

    public String getTypeId() { return typeId; }
    public void setTypeId(String typeId) { this.typeId = typeId; }

    public String getTypeName() { return typeName; }
    public void setTypeName(String typeName) { this.typeName = typeName; }

    public String getYear() { return year; }
    public void setYear(String year) { this.year = year; }

    public String getArea() { return area; }
    public void setArea(String area) { this.area = area; }

    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }

    public String getDirector() { return director; }
    public void setDirector(String director) { this.director = director; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public String getPlayFrom() { return playFrom; }
    public void setPlayFrom(String playFrom) { this.playFrom = playFrom; }

    public String getPlayUrl() { return playUrl; }
    public void setPlayUrl(String playUrl) { this.playUrl = playUrl; }

    public boolean isValid() {
        return id != null && !id.isEmpty() && name != null && !name.isEmpty();
    }

    @Override
    public String toString() {
        return "ContentItem{" + id + ", " + name + "}";
    }
}
