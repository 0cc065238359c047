package com.propertyintel.gap.output;

/**
 * Language of export headers.
 */
public enum LabelLocale {
    KO,
    EN
}
