package com.clipfeed.sampler.api.dto;

public class RatingRequest {
    private Double rating;

    public Double getRating() {
        return rating;
    }

    public void setRating(Double rating) {
        this.rating = rating;
    }
}
