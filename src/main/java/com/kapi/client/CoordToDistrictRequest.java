package com.kapi.client;

import com.kapi.KapiConfig;
import com.kapi.error.DecodeException;
import com.kapi.error.InvalidArgumentException;
import com.kapi.error.RequestBuildException;
import com.kapi.model.CoordSystem;
import com.kapi.model.CoordToDistrictResult;
import com.kapi.model.ResponseFormat;
import com.kapi.util.ResultCodec;
import okhttp3.HttpUrl;
import okhttp3.Request;

import java.math.BigDecimal;

/**
 * Looks up the administrative and legal districts containing a coordinate.
 *
 * <p>Input and output coordinate systems default to {@link CoordSystem#WGS84}; the response
 * format defaults to JSON. A setter given an unknown value throws and keeps the old value.</p>
 */
public class CoordToDistrictRequest extends KapiRequest<CoordToDistrictRequest, CoordToDistrictResult> {

    private final String x;
    private final String y;
    private ResponseFormat format = ResponseFormat.JSON;
    private CoordSystem input = CoordSystem.WGS84;
    private CoordSystem output = CoordSystem.WGS84;

    /**
     * @throws InvalidArgumentException if either coordinate is NaN or infinite
     */
    public CoordToDistrictRequest(KapiConfig config, KapiHttpClient http, double x, double y) {
        super(config, http);
        this.x = plain("x", x);
        this.y = plain("y", y);
    }

    /** Response encoding, "json" or "xml". */
    public CoordToDistrictRequest formatAs(String format) {
        this.format = ResponseFormat.parse(format);
        return this;
    }

    public CoordToDistrictRequest formatAs(ResponseFormat format) {
        this.format = require(format, "format");
        return this;
    }

    /** Coordinate system of x and y. */
    public CoordToDistrictRequest input(String coord) {
        this.input = CoordSystem.parse(coord);
        return this;
    }

    public CoordToDistrictRequest input(CoordSystem coord) {
        this.input = require(coord, "input coordinate system");
        return this;
    }

    /** Coordinate system of the x and y of the returned regions. */
    public CoordToDistrictRequest output(String coord) {
        this.output = CoordSystem.parse(coord);
        return this;
    }

    public CoordToDistrictRequest output(CoordSystem coord) {
        this.output = require(coord, "output coordinate system");
        return this;
    }

    public String x() { return x; }
    public String y() { return y; }
    public ResponseFormat format() { return format; }
    public CoordSystem inputCoord() { return input; }
    public CoordSystem outputCoord() { return output; }

    @Override
    protected Request newRequest() throws RequestBuildException {
        HttpUrl url = endpoint(config.localBaseUrl(), "geo/coord2regioncode." + format.extension())
                .addQueryParameter("x", x)
                .addQueryParameter("y", y)
                .addQueryParameter("input_coord", input.name())
                .addQueryParameter("output_coord", output.name())
                .build();
        return newRequestBuilder(url).get().build();
    }

    @Override
    protected CoordToDistrictResult decode(String body) throws DecodeException {
        CoordToDistrictResult result = ResultCodec.decode(body, CoordToDistrictResult.class, format);
        if (result.meta() == null) {
            throw new DecodeException("Response has no meta");
        }
        return result;
    }

    // Shortest decimal form, never in exponent notation
    private static String plain(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidArgumentException(name + " must be a finite number (got " + value + ")");
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static <E> E require(E value, String what) {
        if (value == null) {
            throw new InvalidArgumentException(what + " must not be null");
        }
        return value;
    }
}
