package com.tarterware.peakfinder.models;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named set of channels interpreted together as one physical measurement,
 * for instance the time gates of one receiver. Channel order matters: it is the
 * order anomalies are clustered in.
 */
@NoArgsConstructor
@AllArgsConstructor
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PropertyGroup
{
    String name;

    List<String> channels = new ArrayList<String>();

    // Hex color used by the presentation layer.
    String color;

    /**
     * Check that the group has a name and a channel list without null ids.
     *
     * @throws IllegalArgumentException if it does not.
     */
    public void validate()
    {
        if (name == null)
        {
            throw new IllegalArgumentException("Property group name is required!");
        }
        if (channels == null)
        {
            throw new IllegalArgumentException("Property group " + name + " has no channel list");
        }
        if (channels.contains(null))
        {
            throw new IllegalArgumentException("Property group " + name + " has a null channel id");
        }
    }

    /**
     * Validate every group of a list.
     *
     * @param propertyGroups Groups to check.
     * @throws IllegalArgumentException if the list is null, holds a null group,
     *                                  or a group is invalid.
     */
    public static void validateAll(List<PropertyGroup> propertyGroups)
    {
        if (propertyGroups == null)
        {
            throw new IllegalArgumentException("propertyGroups are required!");
        }
        for (PropertyGroup propertyGroup : propertyGroups)
        {
            if (propertyGroup == null)
            {
                throw new IllegalArgumentException("propertyGroups cannot hold a null group");
            }
            propertyGroup.validate();
        }
    }
}
