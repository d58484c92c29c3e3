package com.tarterware.peakfinder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PeakFinderApplication
{
    public static void main(String[] args)
    {
        SpringApplication.run(PeakFinderApplication.class, args);
    }
}
