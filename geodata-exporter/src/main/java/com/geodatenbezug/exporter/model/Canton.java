package com.geodatenbezug.exporter.model;

/**
 * The 26 Swiss cantons, in the order geodienste.ch expects them in query strings.
 */
public enum Canton {
    AG, AI, AR, BE, BL, BS, FR, GE, GL, GR, JU, LU, NE,
    NW, OW, SG, SH, SO, SZ, TG, TI, UR, VD, VS, ZG, ZH
}
