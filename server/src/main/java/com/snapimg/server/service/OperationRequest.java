package com.snapimg.server.service;

/**
 * Parameters of one image operation. Which fields matter depends on the
 * operation; unused ones stay null.
 */
public class OperationRequest {
    public Integer width;
    public Integer height;

    // resize / scale
    public String method;
    // resize
    public String cropX;
    public String cropY;
    // crop
    public Integer centerX;
    public Integer centerY;

    // scale-rgb
    public Double r;
    public Double g;
    public Double b;
    // hue-shift
    public Double degrees;

    public OperationRequest() {
    }

    public static OperationRequest ofSize(int width, int height) {
        OperationRequest req = new OperationRequest();
        req.width = width;
        req.height = height;
        return req;
    }
}
