package com.yhy.recourse.flipset.controller;

import com.yhy.recourse.flipset.service.FlipsetService;
import com.yhy.recourse.flipset.vo.FlipsetRequest;
import com.yhy.recourse.flipset.vo.R;
import com.yhy.recourse.mip.SolutionRecord;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;


@RestController()
@RequestMapping(value = "api/recourse")
public class FlipsetController {

    private final FlipsetService flipsetService;

    public FlipsetController(FlipsetService flipsetService) {
        this.flipsetService = flipsetService;
    }

    @PostMapping(value = "fit")
    public R<SolutionRecord> fit(@Valid @RequestBody FlipsetRequest request) {
        return R.ok(flipsetService.fit(request));
    }


    @PostMapping(value = "populate")
    public R<List<SolutionRecord>> populate(@Valid @RequestBody FlipsetRequest request) {
        return R.ok(flipsetService.populate(request));
    }


}
