package com.propertyintel.gap.service;

import com.propertyintel.gap.browser.FakeMapTab;
import com.propertyintel.gap.config.GapScraperProperties;
import com.propertyintel.gap.model.AssetType;
import com.propertyintel.gap.navigation.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapPageLoaderTest {

    private final MapPageLoader loader = new MapPageLoader(new GapScraperProperties());

    @Test
    void scenarioUrl_shouldEncodeFamilyPositionAndType() {
        GeoPoint center = new GeoPoint(37.5608, 126.9888);

        assertEquals("https://new.land.naver.com/complexes?ms=37.5608,126.9888,16&a=APT&b=A1",
                loader.scenarioUrl(AssetType.APT, center, 16));
        assertEquals("https://new.land.naver.com/houses?ms=37.5608,126.9888,15&a=VL&b=A1",
                loader.scenarioUrl(AssetType.VL, center, 15));
    }

    @Test
    void open_shouldPositionTheMapFromTheUrl() {
        FakeMapTab tab = new FakeMapTab(0, 0, 1);

        loader.open(tab, AssetType.APT, new GeoPoint(37.5, 127.0), 16);

        assertEquals(16.0, tab.zoom(), 1e-9);
        assertEquals(37.5, tab.position().latitude(), 1e-9);
    }

    @Test
    void open_shouldThrowWhenNavigationFails() {
        FakeMapTab tab = new FakeMapTab(0, 0, 1) {
            @Override
            public boolean navigate(String url) {
                return false;
            }
        };

        assertThrows(MapLoadException.class, () -> loader.open(tab, AssetType.VL, new GeoPoint(37.5, 127.0), 16));
    }

    @Test
    void isFirstDataResponse_shouldMatchMarkerAndListingCalls() {
        assertTrue(MapPageLoader.isFirstDataResponse(AssetType.APT,
                "https://new.land.naver.com/api/complexes/single-markers/2.0?zoom=16"));
        assertTrue(MapPageLoader.isFirstDataResponse(AssetType.VL,
                "https://new.land.naver.com/api/articles/house/123"));
        assertFalse(MapPageLoader.isFirstDataResponse(AssetType.VL,
                "https://new.land.naver.com/api/complexes/single-markers/2.0"));
        assertFalse(MapPageLoader.isFirstDataResponse(AssetType.APT, "https://new.land.naver.com/static/app.js"));
    }
}
