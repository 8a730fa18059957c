package com.kapi.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.google.gson.annotations.SerializedName;
import com.kapi.error.UnsupportedFormatException;
import com.kapi.util.ResultCodec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Administrative ("H") and legal ("B") districts containing a coordinate.
 *
 * <p>Unlike the other results this one also round-trips through XML, where every region is
 * written as its own {@code <documents>} element directly under {@code <result>}. Plain
 * classes instead of records so Jackson can collect the unwrapped list through the field.</p>
 */
@JacksonXmlRootElement(localName = "result")
public final class CoordToDistrictResult {

    @SerializedName("meta")
    @JsonProperty("meta")
    private Meta meta;

    @SerializedName("documents")
    @JsonProperty("documents")
    @JacksonXmlElementWrapper(useWrapping = false)
    private List<Region> documents;

    private CoordToDistrictResult() {}

    public CoordToDistrictResult(Meta meta, List<Region> documents) {
        this.meta = meta;
        this.documents = List.copyOf(documents);
    }

    public Meta meta() {
        return meta;
    }

    public List<Region> documents() {
        return documents == null ? List.of() : List.copyOf(documents);
    }

    /**
     * @throws UnsupportedFormatException unless the extension is .json or .xml
     */
    public void saveAs(Path file) throws IOException, UnsupportedFormatException {
        ResultCodec.saveAs(this, file, EnumSet.allOf(ResponseFormat.class));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoordToDistrictResult)) return false;
        CoordToDistrictResult that = (CoordToDistrictResult) o;
        return Objects.equals(meta, that.meta) && documents().equals(that.documents());
    }

    @Override
    public int hashCode() {
        return Objects.hash(meta, documents());
    }

    @Override
    public String toString() {
        return ResultCodec.toJson(this);
    }

    public static final class Meta {

        @SerializedName("total_count")
        @JsonProperty("total_count")
        private int totalCount;

        private Meta() {}

        public Meta(int totalCount) {
            this.totalCount = totalCount;
        }

        public int totalCount() {
            return totalCount;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Meta && ((Meta) o).totalCount == totalCount;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(totalCount);
        }
    }

    /**
     * One district. {@code regionType} is "H" for administrative and "B" for legal districts.
     */
    public static final class Region {

        @SerializedName("region_type")
        @JsonProperty("region_type")
        private String regionType;

        @SerializedName("address_name")
        @JsonProperty("address_name")
        private String addressName;

        @SerializedName("region_1depth_name")
        @JsonProperty("region_1depth_name")
        private String region1depthName;

        @SerializedName("region_2depth_name")
        @JsonProperty("region_2depth_name")
        private String region2depthName;

        @SerializedName("region_3depth_name")
        @JsonProperty("region_3depth_name")
        private String region3depthName;

        @SerializedName("region_4depth_name")
        @JsonProperty("region_4depth_name")
        private String region4depthName;

        @SerializedName("code")
        @JsonProperty("code")
        private String code;

        @SerializedName("x")
        @JsonProperty("x")
        private double x;

        @SerializedName("y")
        @JsonProperty("y")
        private double y;

        private Region() {}

        public Region(String regionType, String addressName,
                      String region1depthName, String region2depthName,
                      String region3depthName, String region4depthName,
                      String code, double x, double y) {
            this.regionType = regionType;
            this.addressName = addressName;
            this.region1depthName = region1depthName;
            this.region2depthName = region2depthName;
            this.region3depthName = region3depthName;
            this.region4depthName = region4depthName;
            this.code = code;
            this.x = x;
            this.y = y;
        }

        public String regionType() { return regionType; }
        public String addressName() { return addressName; }
        public String region1depthName() { return region1depthName; }
        public String region2depthName() { return region2depthName; }
        public String region3depthName() { return region3depthName; }
        public String region4depthName() { return region4depthName; }
        public String code() { return code; }
        public double x() { return x; }
        public double y() { return y; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Region)) return false;
            Region r = (Region) o;
            return Double.compare(x, r.x) == 0
                    && Double.compare(y, r.y) == 0
                    && Objects.equals(regionType, r.regionType)
                    && Objects.equals(addressName, r.addressName)
                    && Objects.equals(region1depthName, r.region1depthName)
                    && Objects.equals(region2depthName, r.region2depthName)
                    && Objects.equals(region3depthName, r.region3depthName)
                    && Objects.equals(region4depthName, r.region4depthName)
                    && Objects.equals(code, r.code);
        }

        @Override
        public int hashCode() {
            return Objects.hash(regionType, addressName, region1depthName, region2depthName,
                    region3depthName, region4depthName, code, x, y);
        }
    }
}
